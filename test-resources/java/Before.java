public class Sample {

	private int count;

	public int next(int step) {
		if (step < 0) {
			throw new IllegalArgumentException("negative step");
		}
		count += step;
		return count;
	}

	public void reset() {
		count = 0;
	}
}
