package recursum.models;

// A discovered file together with its position in the output order.
public record PathItem(long sequenceIndex, String path) {
}
