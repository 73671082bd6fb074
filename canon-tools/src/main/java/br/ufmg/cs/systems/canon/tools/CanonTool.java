package br.ufmg.cs.systems.canon.tools;

import br.ufmg.cs.systems.canon.conf.Configuration;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.io.EdgeListGraphReader;
import br.ufmg.cs.systems.canon.io.Graph6GraphReader;
import br.ufmg.cs.systems.canon.io.LabeledGraph;
import br.ufmg.cs.systems.canon.pattern.CanonicalForm;
import br.ufmg.cs.systems.canon.pattern.Canonizer;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Command line entry point.
 *
 * <pre>
 * CanonTool &lt;graph&gt; [labels] [-dot out.dot]
 * CanonTool -g6 &lt;graphs.g6&gt;
 * </pre>
 */
public class CanonTool {
   private static final Logger LOG = Logger.getLogger(CanonTool.class);

   private static final String USAGE =
           "usage: CanonTool <graph> [labels] [-dot out.dot]\n" +
           "       CanonTool -g6 <graphs.g6>";

   private final Canonizer canonizer;
   private final PrintStream out;

   public CanonTool(Configuration configuration, PrintStream out) {
      this.canonizer = new Canonizer(configuration);
      this.out = out;
   }

   public CanonicalForm canonicalizeFile(Path graphPath, Path labelsPath,
                                         Path dotPath) throws IOException {
      LabeledGraph labeled = new EdgeListGraphReader().read(graphPath, labelsPath);
      CanonicalForm form = canonizer.canonicalize(labeled.getGraph(),
              labeled.getLabels());

      out.println("order " + Arrays.toString(form.getNodeOrder()));
      out.println("form " + form.toOutputString());

      if (dotPath != null) {
         GraphVizDotUtil.exportCanonicalForm(form, dotPath);
         LOG.info("Wrote " + dotPath);
      }
      return form;
   }

   public int canonicalizeGraph6(Path path) throws IOException {
      List<MainGraph> graphs;
      try (InputStream is = Files.newInputStream(path)) {
         graphs = new Graph6GraphReader().readAll(is);
      }
      for (MainGraph graph : graphs) {
         out.println(canonizer.canonicalize(graph).toOutputString());
      }
      return graphs.size();
   }

   public static void main(String[] args) throws IOException {
      CanonTool tool = new CanonTool(Configuration.load(), System.out);

      if (args.length == 2 && args[0].equals("-g6")) {
         int numGraphs = tool.canonicalizeGraph6(Paths.get(args[1]));
         LOG.info("Canonicalized " + numGraphs + " graphs");
         return;
      }

      Path graphPath = null;
      Path labelsPath = null;
      Path dotPath = null;
      for (int i = 0; i < args.length; ++i) {
         if (args[i].equals("-dot") && i + 1 < args.length) {
            dotPath = Paths.get(args[++i]);
         } else if (graphPath == null) {
            graphPath = Paths.get(args[i]);
         } else if (labelsPath == null) {
            labelsPath = Paths.get(args[i]);
         } else {
            System.err.println(USAGE);
            System.exit(1);
         }
      }

      if (graphPath == null) {
         System.err.println(USAGE);
         System.exit(1);
      }

      tool.canonicalizeFile(graphPath, labelsPath, dotPath);
   }
}
