package stitcher.taskcenter.execution;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a progress percentage from one worker output line.
 */
@FunctionalInterface
public interface ProgressParser {

    OptionalInt parse(String line);

    static ProgressParser none() {
        return line -> OptionalInt.empty();
    }

    /**
     * Matches the last {@code NN%} or {@code NN.N%} on the line.
     */
    static ProgressParser percent() {
        Pattern pattern = Pattern.compile("(\\d{1,3})(?:\\.\\d+)?\\s*%");
        return line -> {
            Matcher m = pattern.matcher(line);
            Integer last = null;
            while (m.find()) {
                last = Integer.parseInt(m.group(1));
            }
            return last != null && last <= 100 ? OptionalInt.of(last) : OptionalInt.empty();
        };
    }
}
