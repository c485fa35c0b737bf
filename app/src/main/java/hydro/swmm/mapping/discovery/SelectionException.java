package hydro.swmm.mapping.discovery;

/**
 * Raised when an explicitly requested element is not declared anywhere in the model.
 */
public class SelectionException extends RuntimeException {

    public SelectionException(String message) {
        super(message);
    }
}
