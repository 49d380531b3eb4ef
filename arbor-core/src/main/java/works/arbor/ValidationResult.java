package works.arbor;

import java.util.List;

public record ValidationResult(boolean valid, List<String> errors) {
	public ValidationResult {
		errors = List.copyOf(errors);
	}

	public static ValidationResult ok() {
		return OK;
	}

	public static ValidationResult failed(String error) {
		return new ValidationResult(false, List.of(error));
	}

	private static final ValidationResult OK = new ValidationResult(true, List.of());
}
