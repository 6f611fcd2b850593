package dev.jobtracker.service;

import dev.jobtracker.entity.JobPosting;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Sends the new-postings email: an HTML part rendered by Thymeleaf plus a plain-text alternative.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailService {

    private static final DateTimeFormatter SENT_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    private final JavaMailSender mailSender;
    private final TemplateEngine templateEngine;
    private final Clock clock;

    @Value("${spring.mail.username:}")
    private String fromEmail;

    @Value("${tracker.email.to:}")
    private String toEmail;

    static String subject(int count) {
        return String.format("%d New Job Opening%s Found!", count, count == 1 ? "" : "s");
    }

    /**
     * Send one email listing every posting.
     *
     * @return Mono<Boolean> indicating success or failure
     */
    @SuppressWarnings("null")
    public Mono<Boolean> sendNewPostings(List<JobPosting> postings) {
        return Mono.fromCallable(() -> {
            if (toEmail == null || toEmail.isBlank()) {
                log.error("No notification recipient configured (tracker.email.to)");
                return false;
            }
            try {
                MimeMessage message = mailSender.createMimeMessage();
                MimeMessageHelper helper = new MimeMessageHelper(message, true, "UTF-8");

                helper.setFrom(fromEmail);
                helper.setTo(toEmail);
                helper.setSubject(subject(postings.size()));

                String sentAt = LocalDateTime.now(clock).format(SENT_AT);
                helper.setText(generateTextContent(postings, sentAt), generateHtmlContent(postings, sentAt));

                mailSender.send(message);
                log.info("Email with {} postings sent successfully to {}", postings.size(), toEmail);
                return true;

            } catch (MessagingException | MailException e) {
                log.error("Failed to send email: {}", e.getMessage(), e);
                return false;
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private String generateHtmlContent(List<JobPosting> postings, String sentAt) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("postings", postings);
        context.setVariable("count", postings.size());
        context.setVariable("heading", subject(postings.size()));
        context.setVariable("sentAt", sentAt);
        return templateEngine.process("email/new-postings", context);
    }

    String generateTextContent(List<JobPosting> postings, String sentAt) {
        StringBuilder text = new StringBuilder();
        text.append(subject(postings.size())).append("\n\n");
        text.append("The following new positions have been posted:\n\n");

        int index = 1;
        for (JobPosting posting : postings) {
            text.append(index++).append(". ").append(posting.getTitle()).append('\n');
            text.append("   Company: ").append(posting.getCompany()).append('\n');
            text.append("   Location: ")
                    .append(posting.getLocation() != null ? posting.getLocation() : "Not specified").append('\n');
            if (posting.getUrl() != null) {
                text.append("   Link: ").append(posting.getUrl()).append('\n');
            }
            text.append('\n');
        }
        text.append("---\nSent by Job Pipeline Tracker • ").append(sentAt);
        return text.toString();
    }
}
