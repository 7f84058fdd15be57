package recursum.models;

// Hex digest of a file's content and the number of bytes that were read to compute it.
public record FileDigest(String hex, long size) {
}
