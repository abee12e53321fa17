package tree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.Files;

/**
 * Builds diffable trees from Java source code.
 */
public class TreeBuilder {

	private static final Logger logger = LoggerFactory.getLogger(TreeBuilder.class);

	public static Tree buildTreeFromFile(File f) throws IOException {
		String source = Files.asCharSource(f, StandardCharsets.UTF_8).read();
		Tree tree = buildTreeFromSource(source);
		tree.setName(f.getName());
		logger.debug("Built {} from {}", tree, f);
		return tree;
	}

	public static Tree buildTreeFromSource(String source) {
		return buildTreeFromCompilationUnit(getCompilationUnit(source));
	}

	public static Tree buildTreeFromCompilationUnit(CompilationUnit cu){
		JavaCodeVisitor visitor = new JavaCodeVisitor();
		cu.accept(visitor);
		return visitor.getTree();
	}

	public static CompilationUnit getCompilationUnit(String source) {
		ASTParser parser = ASTParser.newParser(AST.JLS11);
		parser.setKind(ASTParser.K_COMPILATION_UNIT);
		Map<String, String> options = JavaCore.getOptions();
		JavaCore.setComplianceOptions(JavaCore.VERSION_11, options);
		parser.setCompilerOptions(options);
		parser.setSource(source.toCharArray());
		CompilationUnit cu = (CompilationUnit)parser.createAST(null);
		for(IProblem problem : cu.getProblems()){
			if(problem.isError())
				logger.debug("Line {}: {}", problem.getSourceLineNumber(), problem.getMessage());
		}
		return cu;
	}
}
