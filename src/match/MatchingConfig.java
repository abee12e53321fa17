package match;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;

/**
 * Thresholds of the two matching phases.
 * <p>
 * <code>minHeight</code> is the smallest subtree height considered by the top-down
 * phase, <code>minDice</code> the smallest similarity accepted by the bottom-up phase.
 * The defaults can be overridden with the system properties
 * <code>treediff.min.height</code> and <code>treediff.min.dice</code>.
 */
public final class MatchingConfig {

	public static final String MIN_HEIGHT_PROPERTY = "treediff.min.height";
	public static final String MIN_DICE_PROPERTY = "treediff.min.dice";
	public static final int DEFAULT_MIN_HEIGHT = 2;
	public static final double DEFAULT_MIN_DICE = 0.5d;

	private final int minHeight;
	private final double minDice;

	public MatchingConfig(int minHeight, double minDice){
		checkArgument(minHeight >= 0, "minHeight must be >= 0 but was %s", minHeight);
		checkArgument(minDice >= 0.0d && minDice <= 1.0d, "minDice must be in [0,1] but was %s", minDice);
		this.minHeight = minHeight;
		this.minDice = minDice;
	}

	public static MatchingConfig defaults(){
		return new MatchingConfig(DEFAULT_MIN_HEIGHT, DEFAULT_MIN_DICE);
	}

	/**
	 * @return a config built from the system properties, falling back to the defaults.
	 * @throws IllegalArgumentException if a property is not a number or out of range.
	 */
	public static MatchingConfig fromSystemProperties(){
		String height = System.getProperty(MIN_HEIGHT_PROPERTY);
		String dice = System.getProperty(MIN_DICE_PROPERTY);
		try{
			return new MatchingConfig(
					height == null ? DEFAULT_MIN_HEIGHT : Integer.parseInt(height.trim()),
					dice == null ? DEFAULT_MIN_DICE : Double.parseDouble(dice.trim()));
		}catch(NumberFormatException e){
			throw new IllegalArgumentException("Invalid matching threshold: " + e.getMessage(), e);
		}
	}

	public MatchingConfig withMinHeight(int minHeight){
		return new MatchingConfig(minHeight, minDice);
	}

	public MatchingConfig withMinDice(double minDice){
		return new MatchingConfig(minHeight, minDice);
	}

	public int getMinHeight() {
		return minHeight;
	}

	public double getMinDice() {
		return minDice;
	}

	@Override
	public boolean equals(Object obj) {
		if(obj instanceof MatchingConfig){
			MatchingConfig other = (MatchingConfig)obj;
			return minHeight == other.minHeight && Double.compare(minDice, other.minDice) == 0;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return 31 * minHeight + Double.hashCode(minDice);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this)
				.add("minHeight", minHeight)
				.add("minDice", minDice)
				.toString();
	}
}
