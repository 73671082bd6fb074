package br.ufmg.cs.systems.canon.conf;

import br.ufmg.cs.systems.canon.graph.EdgeSubdivisionExpander;
import br.ufmg.cs.systems.canon.graph.TriangleEdgeExpander;
import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ConfigurationTest {

   @After
   public void tearDown() {
      System.clearProperty(Configuration.CONF_LOG_TIES);
   }

   @Test
   public void testDefaults() {
      Configuration configuration = new Configuration();

      assertTrue(configuration.isExpandEnabled());
      assertTrue(configuration.logTies());
      assertTrue(configuration.createGraphExpander() instanceof EdgeSubdivisionExpander);
      assertEquals("dreadnaut", configuration.getDreadnautCommand());
   }

   @Test
   public void testOverrides() {
      Configuration configuration = new Configuration()
              .set(Configuration.CONF_GRAPH_EXPAND, false)
              .set(Configuration.CONF_GRAPH_EXPANDER_CLASS,
                      TriangleEdgeExpander.class.getName())
              .set(Configuration.CONF_NAUTY_DREADNAUT, "/opt/nauty/dreadnaut");

      assertFalse(configuration.isExpandEnabled());
      assertTrue(configuration.createGraphExpander() instanceof TriangleEdgeExpander);
      assertEquals("/opt/nauty/dreadnaut", configuration.getDreadnautCommand());
   }

   @Test
   public void testSystemPropertiesOverrideResource() {
      System.setProperty(Configuration.CONF_LOG_TIES, "false");
      Configuration configuration = Configuration.load();

      assertFalse(configuration.logTies());
   }

   @Test(expected = IllegalArgumentException.class)
   public void testExpanderClassMustBeAnExpander() {
      new Configuration()
              .set(Configuration.CONF_GRAPH_EXPANDER_CLASS, String.class.getName())
              .createGraphExpander();
   }

   @Test
   public void testIntegerValues() {
      Configuration configuration = new Configuration().set("canon.some.size", " 12 ");
      assertEquals(Integer.valueOf(12), configuration.getInteger("canon.some.size", 3));
      assertEquals(Integer.valueOf(3), configuration.getInteger("canon.other", 3));
   }
}
