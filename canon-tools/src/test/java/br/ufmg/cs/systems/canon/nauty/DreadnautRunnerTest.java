package br.ufmg.cs.systems.canon.nauty;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.graph.VertexLabels;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.junit.Assume.assumeTrue;

public class DreadnautRunnerTest {
   @Rule
   public TemporaryFolder folder = new TemporaryFolder();

   private static MainGraph path() {
      return BasicMainGraph.builder().addEdge(0, 1).addEdge(1, 2).build();
   }

   @Test
   public void testUnlabeledCommandFile() {
      List<String> lines = DreadnautRunner.commandFile(path(), null);

      assertEquals(Arrays.asList("As", "-a", "-m", "n=3 g",
              " 0 : 1 ;", " 1 : 2 ;", " 2 : ;",
              ".", "+c", "x", "o"), lines);
   }

   @Test
   public void testPartitionFollowsLabels() {
      IntIntMap labels = HashIntIntMaps.newMutableMap();
      labels.put(0, 4);
      labels.put(1, 1);
      labels.put(2, 4);

      List<String> lines = DreadnautRunner.commandFile(path(), labels);

      assertTrue(lines.contains("f=[ 1 | 0  2 ]"));
      assertEquals(".", lines.get(lines.size() - 4));
   }

   @Test(expected = NautyException.class)
   public void testMissingBinary() throws NautyException {
      DreadnautRunner runner = new DreadnautRunner(
              folder.getRoot().getAbsolutePath() + "/no-such-dreadnaut",
              folder.getRoot());
      runner.orbits(path(), null);
   }

   @Test
   public void testFailureCarriesDiagnostics() throws IOException {
      assumeTrue(new File("/bin/sh").canExecute());
      File script = folder.newFile("failing-dreadnaut");
      Files.write(script.toPath(), ("#!/bin/sh\n" +
              "cat > /dev/null\n" +
              "echo 'unknown command q' >&2\n" +
              "exit 3\n").getBytes(StandardCharsets.UTF_8));
      assertTrue(script.setExecutable(true));

      DreadnautRunner runner = new DreadnautRunner(script.getAbsolutePath(),
              folder.getRoot());
      try {
         runner.orbits(path(), null);
         fail();
      } catch (NautyException e) {
         assertTrue(e.getMessage(), e.getMessage().contains("exited with code 3"));
         assertTrue(e.getMessage(), e.getMessage().contains("unknown command q"));
      }
      String[] left = folder.getRoot().list((dir, name) -> name.startsWith("dreadnaut"));
      assertEquals(0, left.length);
   }

   @Test
   public void testApexedUnion() {
      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      IntIntMap labels = HashIntIntMaps.newMutableMap();
      MainGraph path = path();
      int[] pathLabels = VertexLabels.fromMap(path, null);

      int next = DreadnautIsomorphismOracle.addApexed(builder, labels, path,
              pathLabels, 0, 1);
      next = DreadnautIsomorphismOracle.addApexed(builder, labels, path,
              pathLabels, next, 1);
      MainGraph union = builder.build();

      assertEquals(8, next);
      assertEquals(8, union.numVertices());
      assertEquals(2 * (2 + 3), union.numEdges());
      assertEquals(3, union.vertexDegree(union.vertexPosition(3)));
      assertEquals(3, union.vertexDegree(union.vertexPosition(7)));
      assertFalse(union.isNeighbour(union.vertexPosition(3), union.vertexPosition(4)));
      assertEquals(1, labels.get(7));
      assertEquals(0, labels.get(5));
   }
}
