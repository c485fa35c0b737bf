package hydro.swmm.mapping.mapping;

/**
 * Runtime exception used to propagate failures reading or writing interface documents.
 */
public class MappingWriteException extends RuntimeException {

    public MappingWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
