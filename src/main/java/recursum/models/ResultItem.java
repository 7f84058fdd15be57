package recursum.models;

/**
 * Outcome of hashing one {@link PathItem}. Exactly one of {@code digest} and {@code error} is set.
 */
public record ResultItem(long sequenceIndex, String path, String digest, String error, long size) {

    public static ResultItem success(PathItem item, String digest, long size) {
        return new ResultItem(item.sequenceIndex(), item.path(), digest, null, size);
    }

    public static ResultItem failure(PathItem item, String error) {
        return new ResultItem(item.sequenceIndex(), item.path(), null, error, 0);
    }

    public boolean isError() {
        return error != null;
    }
}
