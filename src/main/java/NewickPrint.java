import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Map;
import java.util.OptionalDouble;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.yongkangl.newick.io.DistanceParser;
import com.yongkangl.newick.io.FeatureParser;
import com.yongkangl.newick.io.NewickTreeParser;
import com.yongkangl.newick.io.TreeNode;
import com.yongkangl.newick.nhx.JsonTreeAggregator;
import com.yongkangl.newick.nhx.NhxFeatureParser;
import org.apache.commons.cli.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NewickPrint {
    private static final Logger logger = LoggerFactory.getLogger(NewickPrint.class);

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Options options = new Options();
        options.addOption("f", "file", true, "File path");
        options.addOption("l", "line", true, "Line of input");
        options.addOption("d", "max-depth", true, "Maximum nesting depth");
        options.addOption(null, "nhx", false, "Decode NHX comments");
        options.addOption(null, "json", false, "Print the tree as JSON");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;

        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            err.println("Error parsing command line: " + e.getMessage());
            return 1;
        }

        int line = 1;
        int maxDepth = NewickTreeParser.DEFAULT_MAX_DEPTH;

        if (!cmd.hasOption("file")) {
            err.println("Missing file path");
            return 1;
        }
        String filePath = cmd.getOptionValue("file");
        if (cmd.hasOption("line")) {
            try {
                line = Integer.parseInt(cmd.getOptionValue("line"));
            } catch (NumberFormatException e) {
                err.println("Invalid number for line");
                return 1;
            }
        }
        if (cmd.hasOption("max-depth")) {
            try {
                maxDepth = Integer.parseInt(cmd.getOptionValue("max-depth"));
            } catch (NumberFormatException e) {
                err.println("Invalid number for max depth");
                return 1;
            }
        }
        if (line <= 0 || maxDepth <= 0) {
            err.println("Line and max depth must be positive");
            return 1;
        }

        String inputLine = null;
        try (BufferedReader reader = new BufferedReader(new FileReader(filePath))) {
            for (int i = 0; i < line; i++) {
                inputLine = reader.readLine();
                if (inputLine == null)
                    break;
            }
        } catch (IOException e) {
            err.println("Error reading file: " + e.getMessage());
            return 1;
        }
        if (inputLine == null) {
            err.println("No tree on line " + line + " of " + filePath);
            return 1;
        }
        String newick = inputLine.strip();
        logger.debug("Read tree from line {} of {}", line, filePath);

        FeatureParser<?> featureParser = cmd.hasOption("nhx") ? new NhxFeatureParser() : FeatureParser.identity();
        try {
            if (cmd.hasOption("json")) {
                JsonNode tree = parseJson(newick, featureParser, maxDepth);
                ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
                out.println(mapper.writeValueAsString(tree));
            } else if (cmd.hasOption("nhx")) {
                TreeNode tree = new NewickTreeParser<TreeNode, OptionalDouble, Map<String, String>>(
                        (label, children, distance, features) -> new TreeNode(label, children, distance, features.toString()),
                        DistanceParser.simple(), new NhxFeatureParser(), maxDepth)
                        .parseTree(newick);
                out.print(tree.print());
            } else {
                TreeNode tree = new NewickTreeParser<>(
                        TreeNode.aggregator(), DistanceParser.simple(), FeatureParser.identity(), maxDepth)
                        .parseTree(newick);
                out.print(tree.print());
            }
        } catch (IllegalArgumentException | IOException e) {
            err.println("Error parsing tree: " + e.getMessage());
            return 1;
        }
        return 0;
    }

    private static <F> JsonNode parseJson(String newick, FeatureParser<F> featureParser, int maxDepth) {
        return new NewickTreeParser<>(new JsonTreeAggregator<F>(), DistanceParser.simple(), featureParser, maxDepth)
                .parseTree(newick);
    }
}
