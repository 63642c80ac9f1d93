package FSM.Model;

public record ValidationResult(boolean valid, String message) {

    public static ValidationResult ok(String message) {
        return new ValidationResult(true, message);
    }

    public static ValidationResult fail(String message) {
        return new ValidationResult(false, message);
    }

    @Override
    public String toString() {
        return (valid ? "OK: " : "INVALID: ") + message;
    }
}
