package recursum.output;

import recursum.models.*;
import recursum.utils.*;

/**
 * How one result becomes one output line.
 *
 * @param separator       text between the two fields
 * @param hashFirst       digest before path, as md5sum and friends print it
 * @param digestMaxLength maximum hex digest length, or null for the full digest
 */
public record OutputFormat(String separator, boolean hashFirst, Integer digestMaxLength) {
    public static final String DEFAULT_SEPARATOR = "\t";
    public static final String COMPATIBLE_SEPARATOR = "  ";
    public static final String ERROR_PREFIX = "ERROR: ";

    public OutputFormat {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Separator must not be empty");
        }
        if (digestMaxLength != null && digestMaxLength < 1) {
            throw new IllegalArgumentException("Digest length must be positive: " + digestMaxLength);
        }
    }

    /**
     * Builds the format from command line values. An explicit separator always wins; compatible
     * mode then only swaps the field order.
     */
    public static OutputFormat resolve(String separatorArg, boolean compatible, Integer digestMaxLength) {
        String separator = StringUtils.unescapeSeparator(separatorArg);
        if (separator == null) {
            separator = compatible ? COMPATIBLE_SEPARATOR : DEFAULT_SEPARATOR;
        }
        return new OutputFormat(separator, compatible, digestMaxLength);
    }

    public String format(ResultItem result) {
        String value = result.isError()
                ? ERROR_PREFIX + result.error()
                : DigestUtils.truncate(result.digest(), digestMaxLength);
        return hashFirst
                ? value + separator + result.path()
                : result.path() + separator + value;
    }
}
