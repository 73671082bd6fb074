package br.ufmg.cs.systems.canon.conf;

import br.ufmg.cs.systems.canon.graph.EdgeSubdivisionExpander;
import br.ufmg.cs.systems.canon.graph.GraphExpander;
import br.ufmg.cs.systems.canon.util.ReflectionUtils;
import org.apache.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

public class Configuration implements Serializable {
   private static final Logger LOG = Logger.getLogger(Configuration.class);

   public static final String CONF_RESOURCE = "canon.properties";
   public static final String CONF_PREFIX = "canon.";

   public static final String CONF_GRAPH_EXPAND = "canon.graph.expand";
   public static final boolean CONF_GRAPH_EXPAND_DEFAULT = true;
   public static final String CONF_GRAPH_EXPANDER_CLASS =
           "canon.graph.expander.class";
   public static final String CONF_GRAPH_EXPANDER_CLASS_DEFAULT =
           EdgeSubdivisionExpander.class.getName();
   public static final String CONF_LOG_TIES = "canon.log.ties";
   public static final boolean CONF_LOG_TIES_DEFAULT = true;
   public static final String CONF_NAUTY_DREADNAUT = "canon.nauty.dreadnaut";
   public static final String CONF_NAUTY_DREADNAUT_DEFAULT = "dreadnaut";
   public static final String CONF_NAUTY_TMPDIR = "canon.nauty.tmpdir";
   public static final String CONF_NAUTY_TMPDIR_DEFAULT =
           System.getProperty("java.io.tmpdir");

   private final Properties properties;

   public Configuration() {
      this(new Properties());
   }

   public Configuration(Properties properties) {
      this.properties = new Properties();
      this.properties.putAll(properties);
   }

   /**
    * Configuration from the optional {@value #CONF_RESOURCE} classpath
    * resource, overridden by any {@code canon.*} JVM system property.
    */
   public static Configuration load() {
      Properties properties = new Properties();

      ClassLoader loader = Configuration.class.getClassLoader();
      try (InputStream is = loader.getResourceAsStream(CONF_RESOURCE)) {
         if (is != null) {
            properties.load(is);
            LOG.info("Loaded configuration from " + CONF_RESOURCE);
         }
      } catch (IOException e) {
         throw new RuntimeException(e);
      }

      for (String key : System.getProperties().stringPropertyNames()) {
         if (key.startsWith(CONF_PREFIX)) {
            properties.setProperty(key, System.getProperty(key));
         }
      }

      return new Configuration(properties);
   }

   public Configuration set(String key, Object value) {
      properties.setProperty(key, String.valueOf(value));
      return this;
   }

   public String getString(String key, String defaultValue) {
      return properties.getProperty(key, defaultValue);
   }

   public Boolean getBoolean(String key, Boolean defaultValue) {
      String value = properties.getProperty(key);
      return value == null ? defaultValue : Boolean.valueOf(value.trim());
   }

   public Integer getInteger(String key, Integer defaultValue) {
      String value = properties.getProperty(key);
      return value == null ? defaultValue : Integer.valueOf(value.trim());
   }

   public boolean isExpandEnabled() {
      return getBoolean(CONF_GRAPH_EXPAND, CONF_GRAPH_EXPAND_DEFAULT);
   }

   public boolean logTies() {
      return getBoolean(CONF_LOG_TIES, CONF_LOG_TIES_DEFAULT);
   }

   public Class<? extends GraphExpander> getGraphExpanderClass() {
      return ReflectionUtils.classFor(getString(CONF_GRAPH_EXPANDER_CLASS,
              CONF_GRAPH_EXPANDER_CLASS_DEFAULT), GraphExpander.class);
   }

   public GraphExpander createGraphExpander() {
      return ReflectionUtils.newInstance(getGraphExpanderClass());
   }

   public String getDreadnautCommand() {
      return getString(CONF_NAUTY_DREADNAUT, CONF_NAUTY_DREADNAUT_DEFAULT);
   }

   public String getNautyTmpDir() {
      return getString(CONF_NAUTY_TMPDIR, CONF_NAUTY_TMPDIR_DEFAULT);
   }

   @Override
   public String toString() {
      return "Configuration{" + properties + "}";
   }
}
