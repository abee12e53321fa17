package main;

import java.io.File;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import diff.TreeDiff;
import match.MatchingConfig;
import script.model.EditOp;
import script.model.EditScript;
import tree.Tree;
import tree.TreeBuilder;

public class TreeDiffCli {

	private static final Logger logger = LoggerFactory.getLogger(TreeDiffCli.class);

	static final int EXIT_OK = 0;
	static final int EXIT_IO_ERROR = 1;
	static final int EXIT_USAGE = 2;

	public static void main(String[] args) {
		System.exit(run(args));
	}

	static int run(String[] args) {
		if(args.length < 2){
			System.err.println("Usage: TreeDiffCli <before.java> <after.java>");
			return EXIT_USAGE;
		}
		MatchingConfig config;
		try {
			config = MatchingConfig.fromSystemProperties();
		} catch (IllegalArgumentException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			return EXIT_USAGE;
		}
		File b = new File(args[0]);
		File a = new File(args[1]);
		try {
			Tree before = TreeBuilder.buildTreeFromFile(b);
			Tree after = TreeBuilder.buildTreeFromFile(a);
			logger.info("Comparing {} with {} using {}", before, after, config);

			EditScript script = TreeDiff.diff(before, after, config);
			for(EditOp op : script.getEditOps()){
				System.out.println(op.toOpString());
			}
			logger.info("{} edit operations", script.size());
			return EXIT_OK;
		} catch (IOException e) {
			logger.error("Cannot read input: {}", e.getMessage(), e);
			return EXIT_IO_ERROR;
		}
	}
}
