package dev.ocip.harvester.engine;

/** Aborts the running phase; the checkpoint is not advanced any further */
public class FatalPhaseException extends RuntimeException {
	private final FatalCause fatalCause;

	public FatalPhaseException(FatalCause fatalCause, String message) {
		super(message);
		this.fatalCause = fatalCause;
	}

	public FatalPhaseException(FatalCause fatalCause, String message, Throwable cause) {
		super(message, cause);
		this.fatalCause = fatalCause;
	}

	public FatalCause fatalCause() {
		return fatalCause;
	}
}
