package com.pagesmith.cli;

import com.pagesmith.core.site.BuildReport;

/**
 * Prints a {@link BuildReport} to the console.
 */
final class ReportPrinter {

    private ReportPrinter() {
    }

    static void print(BuildReport report, String successLabel) {
        System.out.printf("✓ %s %d pages%n", successLabel, report.succeeded().size());
        if (!report.skipped().isEmpty()) {
            System.out.printf("• Skipped %d unpublished pages%n", report.skipped().size());
        }
        if (!report.failed().isEmpty()) {
            System.out.printf("✗ %d pages failed:%n", report.failed().size());
            for (BuildReport.Failure failure : report.failed()) {
                System.out.printf("    %s: %s%n", failure.source(), failure.message());
            }
        }
    }
}
