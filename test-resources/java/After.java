public class Sample {

	private int count;

	public void reset() {
		count = 0;
	}

	public int next(int step) {
		if (step <= 0) {
			throw new IllegalArgumentException("step must be positive");
		}
		count += step;
		log(count);
		return count;
	}
}
