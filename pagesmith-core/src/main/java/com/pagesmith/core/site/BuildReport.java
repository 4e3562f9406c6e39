package com.pagesmith.core.site;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of building a set of pages.
 *
 * @param succeeded sources built successfully (written, or validated in check mode)
 * @param skipped sources left out because they are not published
 * @param failed sources that failed, with the reason
 */
public record BuildReport(
    List<Path> succeeded,
    List<Path> skipped,
    List<Failure> failed
) {

    /**
     * Compact constructor with validation.
     */
    public BuildReport {
        succeeded = List.copyOf(Objects.requireNonNull(succeeded, "succeeded must not be null"));
        skipped = List.copyOf(Objects.requireNonNull(skipped, "skipped must not be null"));
        failed = List.copyOf(Objects.requireNonNull(failed, "failed must not be null"));
    }

    /**
     * A page that could not be built.
     *
     * @param source source file
     * @param message failure description
     */
    public record Failure(Path source, String message) {}

    /**
     * @return true if no page failed
     */
    public boolean isSuccessful() {
        return failed.isEmpty();
    }

    /**
     * @return number of sources processed
     */
    public int total() {
        return succeeded.size() + skipped.size() + failed.size();
    }
}
