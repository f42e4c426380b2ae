package json.java17.engine;

/// Outcome of [JsonReader#read]: either a document or an error, never both.
///
/// The document is owned by the caller and must be closed to return its
/// storage to the allocator.
public record ReadResult(JsonDoc doc, ReadError error) {

    public ReadResult {
        if ((doc == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of doc and error must be present");
        }
    }

    static ReadResult success(JsonDoc doc) {
        return new ReadResult(doc, null);
    }

    static ReadResult failure(ReadCode code, String message, long position) {
        return new ReadResult(null, new ReadError(code, message, position));
    }

    /// {@return `true` when a document was produced}
    public boolean isSuccess() {
        return doc != null;
    }
}
