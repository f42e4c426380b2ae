package json.java17.dynamic;

/// Thrown by [ValueMapper] when a tree cannot be mapped.
/// [JsonDynamic] turns it into a result carrying [#code()] and the message.
public class JsonMappingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final MappingCode code;

    public JsonMappingException(MappingCode code, String message) {
        super(message);
        this.code = code;
    }

    public MappingCode code() {
        return code;
    }
}
