package br.ufmg.cs.systems.canon.tools;

import br.ufmg.cs.systems.canon.pattern.CanonicalForm;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

public class GraphVizDotUtil {

   /**
    * Writes the canonical form as an undirected dot graph: one node per
    * canonical position, labeled {@code position,{vertex id},label} and
    * filled with a color derived from its label.
    */
   public static void exportCanonicalForm(CanonicalForm form, Path path)
           throws IOException {
      try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
         exportCanonicalForm(form, writer);
      }
   }

   public static void exportCanonicalForm(CanonicalForm form, Writer writer) {
      PrintWriter pw = new PrintWriter(writer);
      pw.printf("graph {\n");
      pw.printf("\tnode [colorscheme=pastel19];\n");

      int numVertices = form.numVertices();
      int[] nodeOrder = form.getNodeOrder();
      int[] labels = form.getOrderedLabels();
      IntIntMap colorMap = HashIntIntMaps.newUpdatableMap();

      for (int u = 0; u < numVertices; ++u) {
         int label = labels[u];
         if (!colorMap.containsKey(label)) {
            Random random = new Random(label);
            int randomColor = (int) (random.nextDouble() * 0x1000000);
            colorMap.put(label, randomColor);
         }
         pw.printf("\t%d [style=\"filled,solid\"," +
                         "color=black,fillcolor=\"#%06x\"," +
                         "label=\"%d,{%d},%d\"];" +
                         "\n",
                 u, colorMap.get(label), u, nodeOrder[u], label);
      }

      for (int u = 0; u < numVertices; ++u) {
         for (int v = u + 1; v < numVertices; ++v) {
            if (form.isAdjacent(u, v)) {
               pw.printf("\t%d -- %d;\n", u, v);
            }
         }
      }

      pw.printf("}\n");
      pw.flush();
   }
}
