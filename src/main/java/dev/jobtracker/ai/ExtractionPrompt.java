package dev.jobtracker.ai;

/**
 * Instructions sent to the model ahead of the cleaned page content.
 */
public final class ExtractionPrompt {

    private static final String INSTRUCTIONS = """
            You are a job listing extractor. Analyze the page content below and extract ALL job postings you can find.

            For each job, extract:
            - title: The job title
            - company: Company name (if visible, otherwise use "Unknown")
            - location: Job location (if visible, otherwise use "Not specified")
            - url: Link to the job posting exactly as it appears in the page (if available, otherwise use "")

            Return ONLY a valid JSON array. If no jobs are found, return an empty array [].

            Example output:
            [
              {"title": "Software Engineer", "company": "Acme", "location": "Mountain View, CA", "url": "https://acme.example/jobs/1"},
              {"title": "Data Analyst", "company": "Acme", "location": "New York, NY", "url": "/jobs/2"}
            ]
            """;

    private ExtractionPrompt() {
    }

    // Concatenated rather than formatted: page content is full of braces and percent signs
    public static String build(String content, String sourceHint) {
        StringBuilder prompt = new StringBuilder(INSTRUCTIONS.length() + content.length() + 128);
        prompt.append(INSTRUCTIONS);
        if (sourceHint != null && !sourceHint.isBlank()) {
            prompt.append("\nThe page belongs to: ").append(sourceHint).append('\n');
        }
        prompt.append("\nPage content to analyze:\n\n").append(content);
        return prompt.toString();
    }
}
