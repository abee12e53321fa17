package match;

import java.util.Comparator;
import java.util.PriorityQueue;

/**
 * Match candidates ordered by similarity, highest first. Equal similarities are
 * ordered by preorder index so the earliest candidate wins.
 */
public class Candidates {

	private PriorityQueue<Candidate> candidates;

	public Candidates(){
		candidates = new PriorityQueue<Candidate>(2, new Comparator<Candidate>() {
			@Override
			public int compare(Candidate c1, Candidate c2) {
				int result = -1*Double.compare(c1.similarity, c2.similarity);
				return result != 0 ? result : Integer.compare(c1.order, c2.order);
			}
		});
	}

	public void addCandidate(int node, int order, double similarity){
		candidates.add(new Candidate(node, order, similarity));
	}

	public Candidate peek(){
		return candidates.peek();
	}

	public Candidate poll(){
		return candidates.poll();
	}

	public boolean isEmpty(){
		return candidates.isEmpty();
	}

	public int size(){
		return candidates.size();
	}

	public static class Candidate {
		private final int node;
		private final int order;
		private final double similarity;

		public Candidate(int node, int order, double similarity){
			this.node = node;
			this.order = order;
			this.similarity = similarity;
		}

		public int getNode() {
			return node;
		}

		public double getSimilarity() {
			return similarity;
		}

		@Override
		public String toString() {
			return node + "(" + similarity + ")";
		}
	}
}
