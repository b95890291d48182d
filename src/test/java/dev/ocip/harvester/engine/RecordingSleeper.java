package dev.ocip.harvester.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/** Sleeper that only records the requested waits */
public class RecordingSleeper implements Sleeper {
	private final List<Duration> sleeps = new ArrayList<>();

	@Override
	public void sleep(Duration duration) {
		sleeps.add(duration);
	}

	public List<Duration> sleeps() {
		return sleeps;
	}
}
