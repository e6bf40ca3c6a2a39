package tree.ukkonen;

// Thrown when a suffix tree is requested for a zero-length text.
public class EmptyTextException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public EmptyTextException() {
        super("text cannot be empty");
    }
}
