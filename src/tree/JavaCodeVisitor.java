package tree;

import java.util.ArrayDeque;
import java.util.Deque;

import org.eclipse.jdt.core.dom.ASTNode;
import org.eclipse.jdt.core.dom.ASTVisitor;
import org.eclipse.jdt.core.dom.Assignment;
import org.eclipse.jdt.core.dom.BooleanLiteral;
import org.eclipse.jdt.core.dom.CharacterLiteral;
import org.eclipse.jdt.core.dom.ExpressionStatement;
import org.eclipse.jdt.core.dom.InfixExpression;
import org.eclipse.jdt.core.dom.Modifier;
import org.eclipse.jdt.core.dom.NumberLiteral;
import org.eclipse.jdt.core.dom.PostfixExpression;
import org.eclipse.jdt.core.dom.PrefixExpression;
import org.eclipse.jdt.core.dom.PrimitiveType;
import org.eclipse.jdt.core.dom.QualifiedName;
import org.eclipse.jdt.core.dom.QualifiedType;
import org.eclipse.jdt.core.dom.SimpleName;
import org.eclipse.jdt.core.dom.SimpleType;
import org.eclipse.jdt.core.dom.StringLiteral;
import org.eclipse.jdt.core.dom.SwitchCase;
import org.eclipse.jdt.core.dom.SwitchExpression;
import org.eclipse.jdt.core.dom.SwitchStatement;

/**
 * Builds a {@link Tree} from a JDT AST.
 * <p>
 * Unless <code>treediff.java.full.ast</code> is set, expression statements are left
 * out, type and qualified name nodes are kept as leaves, and the statements following
 * a switch case are put under the case.
 */
public class JavaCodeVisitor extends ASTVisitor {

	public static final String FULL_AST_PROPERTY = "treediff.java.full.ast";
	public static final String OPERATOR = "operator";

	private final boolean fullAst;
	private Tree tree;
	private final Deque<Integer> nodeStack;
	//One entry per switch being visited, true once its first case was seen.
	private final Deque<Boolean> switchStack;

	public JavaCodeVisitor(){
		this(Boolean.getBoolean(FULL_AST_PROPERTY));
	}

	public JavaCodeVisitor(boolean fullAst){
		this.fullAst = fullAst;
		this.nodeStack = new ArrayDeque<Integer>();
		this.switchStack = new ArrayDeque<Boolean>();
	}

	/**
	 * @return the tree built so far, or null if nothing was visited.
	 */
	public Tree getTree(){
		return tree;
	}

	@Override
	public void preVisit(ASTNode node) {
		if(!fullAst && node instanceof ExpressionStatement)
			return;
		if(!fullAst){
			if(isSwitch(node)){
				switchStack.push(false);
			}else if(node instanceof SwitchCase && !switchStack.isEmpty()){
				//A new case closes the previous one.
				if(switchStack.peek()){
					nodeStack.pop();
				}else{
					switchStack.pop();
					switchStack.push(true);
				}
			}
		}
		nodeStack.push(addNode(node));
	}

	@Override
	public void postVisit(ASTNode node) {
		if(!fullAst && node instanceof ExpressionStatement)
			return;
		int current = nodeStack.pop();
		if(!fullAst){
			if(node instanceof SwitchCase && !switchStack.isEmpty()){
				//Keep the case open for the statements that follow it.
				nodeStack.push(current);
			}else if(isSwitch(node) && !switchStack.isEmpty()){
				if(switchStack.pop()){
					//current is the last case, the switch itself is below it.
					nodeStack.pop();
				}
			}
		}
	}

	@Override
	public boolean visit(QualifiedName node){
		return false;
	}

	@Override
	public boolean visit(SimpleType node){
		return fullAst;
	}

	@Override
	public boolean visit(QualifiedType node){
		return fullAst;
	}

	@Override
	public boolean visit(PrimitiveType node){
		return fullAst;
	}

	private static boolean isSwitch(ASTNode node){
		return node instanceof SwitchStatement || node instanceof SwitchExpression;
	}

	private int addNode(ASTNode node) {
		NodeData data = getNodeData(node);
		if(tree == null){
			tree = new Tree(data);
			return Tree.ROOT;
		}
		return tree.addChild(nodeStack.peek(), data);
	}

	static NodeData getNodeData(ASTNode node){
		String kind = node.getClass().getSimpleName();
		String value = getValue(node);
		NodeData data = value == null ? NodeData.of(kind) : NodeData.leaf(kind, value);
		String operator = getOperator(node);
		if(operator != null)
			data = data.withProperties(MapProperties.of(OPERATOR, operator));
		return data;
	}

	private static String getValue(ASTNode node){
		if(node instanceof BooleanLiteral
				|| node instanceof Modifier
				|| node instanceof SimpleType
				|| node instanceof QualifiedType
				|| node instanceof PrimitiveType)
			return node.toString();
		if(node instanceof CharacterLiteral)
			return ((CharacterLiteral)node).getEscapedValue();
		if(node instanceof NumberLiteral)
			return ((NumberLiteral)node).getToken();
		if(node instanceof StringLiteral)
			return ((StringLiteral)node).getEscapedValue();
		if(node instanceof SimpleName)
			return ((SimpleName)node).getIdentifier();
		if(node instanceof QualifiedName)
			return ((QualifiedName)node).getFullyQualifiedName();
		return null;
	}

	private static String getOperator(ASTNode node){
		if(node instanceof Assignment)
			return ((Assignment)node).getOperator().toString();
		if(node instanceof InfixExpression)
			return ((InfixExpression)node).getOperator().toString();
		if(node instanceof PrefixExpression)
			return ((PrefixExpression)node).getOperator().toString();
		if(node instanceof PostfixExpression)
			return ((PostfixExpression)node).getOperator().toString();
		return null;
	}
}
