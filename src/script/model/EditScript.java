package script.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An ordered, unmodifiable list of edit operations.
 */
public class EditScript implements Iterable<EditOp> {

	private static final EditScript EMPTY = new EditScript(ImmutableList.<EditOp>of());

	private final ImmutableList<EditOp> operations;

	public EditScript(List<? extends EditOp> operations){
		this.operations = ImmutableList.copyOf(operations);
	}

	public static EditScript empty(){
		return EMPTY;
	}

	public List<EditOp> getEditOps(){
		return operations;
	}

	/**
	 * @return the top-level ops followed, each, by the ops nested under them.
	 */
	public List<EditOp> getAllEditOps(){
		List<EditOp> editOps = new ArrayList<>();
		for(EditOp op : operations){
			editOps.addAll(op.getSubtreeEdit());
		}
		return editOps;
	}

	public EditOp get(int index){
		return operations.get(index);
	}

	public int size(){
		return operations.size();
	}

	public boolean isEmpty(){
		return operations.isEmpty();
	}

	@Override
	public Iterator<EditOp> iterator() {
		return operations.iterator();
	}

	@Override
	public String toString(){
		StringBuilder sb = new StringBuilder();
		for(EditOp op : operations){
			sb.append(op.toOpString());
			sb.append("\n");
		}
		return sb.toString();
	}
}
