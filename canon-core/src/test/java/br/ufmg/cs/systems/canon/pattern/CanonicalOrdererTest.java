package br.ufmg.cs.systems.canon.pattern;

import br.ufmg.cs.systems.canon.conf.Configuration;
import br.ufmg.cs.systems.canon.graph.GraphFixtures;
import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CanonicalOrdererTest {
   private final Logger ordererLogger = Logger.getLogger(CanonicalOrderer.class);
   private final CollectingAppender appender = new CollectingAppender();
   private Level previousLevel;

   @Before
   public void setUp() {
      previousLevel = ordererLogger.getLevel();
      ordererLogger.setLevel(Level.INFO);
      ordererLogger.addAppender(appender);
   }

   @After
   public void tearDown() {
      ordererLogger.removeAppender(appender);
      ordererLogger.setLevel(previousLevel);
   }

   @Test
   public void testFurtherSortRanksPairs() {
      int[] remaining = {0, 1, 2, 3};
      int[] keys = {1, 0, 1, 0};
      long[] values = {5, 3, 2, 3};

      CanonicalOrderer.furtherSort(remaining, 4, keys, pos -> values[pos]);

      assertArrayEquals(new int[]{1, 3, 2, 0}, remaining);
      assertArrayEquals(new int[]{2, 0, 1, 0}, keys);
   }

   @Test
   public void testFurtherSortOnlyTouchesRemaining() {
      int[] remaining = {2, 0, 1};
      int[] keys = {0, 0, 0};

      CanonicalOrderer.furtherSort(remaining, 2, keys, pos -> -pos);

      assertArrayEquals(new int[]{2, 0, 1}, remaining);
      assertArrayEquals(new int[]{1, 0, 0}, keys);
   }

   @Test
   public void testSelectFirstUniqueKey() {
      int[] remaining = {3, 1, 0, 2};
      int[] keys = {1, 0, 2, 0};

      Selection selection = CanonicalOrderer.select(remaining, 4, keys);

      assertTrue(selection.isStable());
      assertEquals(2, selection.getIndex());
   }

   @Test
   public void testSelectNeedsTieBreak() {
      int[] remaining = {0, 2, 1, 3};
      int[] keys = {0, 1, 0, 1};

      Selection selection = CanonicalOrderer.select(remaining, 4, keys);

      assertFalse(selection.isStable());
      assertArrayEquals(new int[]{0, 2}, selection.getTiedGroup());
   }

   @Test
   public void testSingleRemainingIsStable() {
      Selection selection = CanonicalOrderer.select(new int[]{4}, 1, new int[]{0, 0, 0, 0, 7});
      assertTrue(selection.isStable());
      assertEquals(0, selection.getIndex());
   }

   @Test
   public void testTieIsLogged() {
      new Canonizer().canonicalize(GraphFixtures.triangle());

      assertTrue(appender.messages.toString(),
              appender.messages.contains("Chose the 2th node with a tie (1-indexed)."));
   }

   @Test
   public void testTieLoggingCanBeTurnedOff() {
      Configuration configuration = new Configuration()
              .set(Configuration.CONF_LOG_TIES, false);
      new Canonizer(configuration).canonicalize(GraphFixtures.triangle());

      assertTrue(appender.messages.isEmpty());
   }

   @Test
   public void testNoTieOnAsymmetricGraph() {
      new Canonizer().canonicalize(GraphFixtures.asymmetric());

      assertTrue(appender.messages.toString(), appender.messages.isEmpty());
   }

   private static class CollectingAppender extends AppenderSkeleton {
      private final List<String> messages = new ArrayList<>();

      @Override
      protected void append(LoggingEvent event) {
         messages.add(event.getRenderedMessage());
      }

      @Override
      public void close() {
      }

      @Override
      public boolean requiresLayout() {
         return false;
      }
   }
}
