package dev.jobtracker.service;

import dev.jobtracker.entity.JobPosting;
import jakarta.mail.internet.MimeMessage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.test.util.ReflectionTestUtils;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.IContext;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EmailServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private JavaMailSender mailSender;

    @Mock
    private TemplateEngine templateEngine;

    @Mock
    private MimeMessage mimeMessage;

    private EmailService emailService;

    @BeforeEach
    void setUp() {
        emailService = new EmailService(mailSender, templateEngine, CLOCK);
        ReflectionTestUtils.setField(Objects.requireNonNull(emailService), "fromEmail", "tracker@example.com");
        ReflectionTestUtils.setField(Objects.requireNonNull(emailService), "toEmail", "me@example.com");
    }

    private JobPosting posting(long id, String title, String location, String url) {
        return JobPosting.builder()
                .id(id)
                .sourceId(1L)
                .identityKey("u:" + id)
                .title(title)
                .company("Acme")
                .location(location)
                .url(url)
                .firstSeen(LocalDateTime.now(CLOCK))
                .lastSeen(LocalDateTime.now(CLOCK))
                .build();
    }

    @Nested
    @DisplayName("Send new postings")
    class SendTests {

        @Test
        @DisplayName("Should send email successfully")
        @SuppressWarnings("null")
        void shouldSendEmailSuccessfully() {
            when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
            when(templateEngine.process(eq("email/new-postings"), any(IContext.class)))
                    .thenReturn("<html>2 postings</html>");

            StepVerifier.create(emailService.sendNewPostings(List.of(
                            posting(1, "Backend Engineer", "Remote", "https://acme.example/jobs/1"),
                            posting(2, "Designer", null, null))))
                    .expectNext(true)
                    .verifyComplete();

            verify(mailSender).send(mimeMessage);
        }

        @Test
        @DisplayName("Should return false when the transport fails")
        @SuppressWarnings("null")
        void shouldReturnFalseOnMailException() {
            when(mailSender.createMimeMessage()).thenReturn(mimeMessage);
            when(templateEngine.process(eq("email/new-postings"), any(IContext.class))).thenReturn("<html/>");
            doThrow(new MailSendException("SMTP error")).when(mailSender).send(any(MimeMessage.class));

            StepVerifier.create(emailService.sendNewPostings(List.of(posting(1, "Backend Engineer", null, null))))
                    .expectNext(false)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should return false without a recipient")
        void shouldReturnFalseWithoutRecipient() {
            ReflectionTestUtils.setField(Objects.requireNonNull(emailService), "toEmail", "");

            StepVerifier.create(emailService.sendNewPostings(List.of(posting(1, "Backend Engineer", null, null))))
                    .expectNext(false)
                    .verifyComplete();

            verifyNoInteractions(mailSender);
        }
    }

    @Nested
    @DisplayName("Content")
    class ContentTests {

        @Test
        @DisplayName("Should build a subject with the posting count")
        void shouldBuildSubject() {
            assertThat(EmailService.subject(1)).isEqualTo("1 New Job Opening Found!");
            assertThat(EmailService.subject(3)).isEqualTo("3 New Job Openings Found!");
        }

        @Test
        @DisplayName("Should list every posting in the plain-text part")
        void shouldRenderPlainText() {
            String text = emailService.generateTextContent(List.of(
                    posting(1, "Backend Engineer", "Remote", "https://acme.example/jobs/1"),
                    posting(2, "Designer", null, null)), "2026-03-02 09:00");

            assertThat(text)
                    .startsWith("2 New Job Openings Found!")
                    .contains("1. Backend Engineer")
                    .contains("Link: https://acme.example/jobs/1")
                    .contains("2. Designer")
                    .contains("Location: Not specified")
                    .endsWith("2026-03-02 09:00");
        }
    }
}
