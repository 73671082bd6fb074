package br.ufmg.cs.systems.canon.refinement;

import br.ufmg.cs.systems.canon.util.InvariantViolationException;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class LabelAssignmentTest {

   @Test
   public void testAssignFollowsKeyOrder() {
      LabelAssignment<Integer> assignment =
              LabelAssignment.assign(new Integer[]{7, 3, 7, 5});

      assertArrayEquals(new int[]{2, 0, 2, 1}, assignment.getLabels());
      assertEquals(Arrays.asList(3, 5, 7), assignment.getDefinitions());
      assertEquals(3, assignment.numLabels());
   }

   @Test
   public void testSameGroupingUnderRotatedNumbering() {
      assertTrue(LabelAssignment.sameGrouping(new int[]{0, 0, 1, 2},
              new int[]{2, 2, 0, 1}));
      assertTrue(LabelAssignment.sameGrouping(new int[]{5, 1, 5, 9},
              new int[]{0, 1, 0, 2}));
   }

   @Test
   public void testSplitIsNotSameGrouping() {
      assertFalse(LabelAssignment.sameGrouping(new int[]{0, 0, 1, 1},
              new int[]{0, 1, 2, 2}));
      assertFalse(LabelAssignment.sameGrouping(new int[]{0, 1, 2, 2},
              new int[]{0, 1, 1, 2}));
   }

   @Test
   public void testSplittingRoundPasses() {
      LabelAssignment.checkProgress(new int[]{0, 0, 1, 1}, new int[]{0, 1, 2, 2}, 1, 4);
      LabelAssignment.checkProgress(new int[]{0, 0, 0}, new int[]{0, 0, 0}, 3, 3);
   }

   @Test
   public void testMergeWithSameLabelCountFails() {
      // one split and one merge leave three labels either way
      try {
         LabelAssignment.checkProgress(new int[]{0, 0, 1, 2}, new int[]{0, 1, 2, 2}, 1, 4);
         fail();
      } catch (InvariantViolationException e) {
         assertTrue(e.getMessage().contains("merged"));
      }
   }

   @Test(expected = InvariantViolationException.class)
   public void testPlainMergeFails() {
      LabelAssignment.checkProgress(new int[]{0, 1, 2}, new int[]{0, 0, 1}, 1, 3);
   }

   @Test
   public void testTooManyRoundsFails() {
      try {
         LabelAssignment.checkProgress(new int[]{0, 1}, new int[]{0, 1}, 3, 2);
         fail();
      } catch (InvariantViolationException e) {
         assertTrue(e.getMessage().contains("did not stabilize"));
      }
   }
}
