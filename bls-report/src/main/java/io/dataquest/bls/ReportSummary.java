package io.dataquest.bls;

import java.util.List;

/**
 * What one run produced. {@code artifacts} were written locally; {@code uploaded} and {@code failedUploads} are
 * full object keys including the results prefix.
 */
public record ReportSummary(ReportSet reports, List<String> artifacts, List<String> uploaded, List<String> failedUploads) {
    public ReportSummary {
        artifacts = List.copyOf(artifacts);
        uploaded = List.copyOf(uploaded);
        failedUploads = List.copyOf(failedUploads);
    }
}
