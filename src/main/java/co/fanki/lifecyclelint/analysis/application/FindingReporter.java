package co.fanki.lifecyclelint.analysis.application;

import co.fanki.lifecyclelint.analysis.domain.Finding;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders findings as tab separated lines.
 *
 * <p>The line format is {@code path:line[:col]<TAB>kind[<TAB>message]}.
 * Findings repeating the file, position, kind and message of an earlier
 * one are dropped; everything else keeps the order the detector produced.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class FindingReporter {

    /**
     * Formats one finding.
     *
     * @param finding the finding
     * @return the report line, without line terminator
     */
    public String format(final Finding finding) {
        final StringBuilder line = new StringBuilder()
                .append(finding.path())
                .append(':')
                .append(finding.line());
        if (finding.column() != null) {
            line.append(':').append(finding.column());
        }
        line.append('\t').append(finding.kind());
        if (finding.message() != null && !finding.message().isEmpty()) {
            line.append('\t').append(finding.message());
        }
        return line.toString();
    }

    /**
     * Formats findings, dropping duplicates.
     *
     * @param findings the findings in detector order
     * @return the report lines
     */
    public List<String> render(final List<Finding> findings) {
        final Set<DedupKey> seen = new HashSet<>();
        final List<String> lines = new ArrayList<>();
        for (final Finding finding : findings) {
            if (seen.add(new DedupKey(finding.path(), finding.line(),
                    finding.column(), finding.kind(), finding.message()))) {
                lines.add(format(finding));
            }
        }
        return lines;
    }

    /**
     * Prints findings, one per line.
     *
     * @param findings the findings in detector order
     * @param out the output stream
     * @return the number of lines printed
     */
    public int print(final List<Finding> findings, final PrintStream out) {
        final List<String> lines = render(findings);
        lines.forEach(out::println);
        out.flush();
        return lines.size();
    }

    private record DedupKey(String path, int line, Integer column,
            String kind, String message) {}

}
