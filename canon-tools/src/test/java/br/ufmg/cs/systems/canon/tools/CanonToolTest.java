package br.ufmg.cs.systems.canon.tools;

import br.ufmg.cs.systems.canon.conf.Configuration;
import br.ufmg.cs.systems.canon.pattern.CanonicalForm;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class CanonToolTest {
   @Rule
   public TemporaryFolder folder = new TemporaryFolder();

   private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
   private final CanonTool tool = new CanonTool(new Configuration(),
           new PrintStream(bytes, true));

   private Path write(String name, String content) throws IOException {
      Path path = folder.getRoot().toPath().resolve(name);
      Files.write(path, content.getBytes(StandardCharsets.UTF_8));
      return path;
   }

   private String output() {
      return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
   }

   @Test
   public void testIsomorphicFilesPrintTheSameForm() throws IOException {
      Path first = write("first.txt", "0 1\n1 2\n2 3\n");
      Path second = write("second.txt", "10 30\n30 20\n20 40\n");

      CanonicalForm a = tool.canonicalizeFile(first, null, null);
      CanonicalForm b = tool.canonicalizeFile(second, null, null);

      assertEquals(a, b);
      String[] lines = output().split("\n");
      assertEquals(4, lines.length);
      assertEquals(lines[1], lines[3]);
      assertTrue(lines[0].startsWith("order ["));
   }

   @Test
   public void testLabelsAndDotExport() throws IOException {
      Path graph = write("graph.txt", "0 1 2\n");
      Path labels = write("labels.txt", "0 1\n1 0\n2 0\n");
      Path dot = folder.getRoot().toPath().resolve("form.dot");

      CanonicalForm form = tool.canonicalizeFile(graph, labels, dot);

      assertEquals(3, form.numVertices());
      assertTrue(Files.exists(dot));
      assertTrue(new String(Files.readAllBytes(dot), StandardCharsets.UTF_8)
              .contains(" -- "));
   }

   @Test
   public void testGraph6File() throws IOException {
      Path graphs = write("graphs.g6", "Bw\nBg\n");

      assertEquals(2, tool.canonicalizeGraph6(graphs));
      assertEquals(2, output().split("\n").length);
   }
}
