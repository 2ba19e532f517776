/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.seqwrite4j.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Extract all of the entries whose key starts with {@code sectionName + "."}. When
     * {@code removeSectionName} is set the prefix is stripped from the resulting keys.
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();
        final String prefix = sectionName + separator;

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(prefix)) {
                final String newkey = removeSectionName ? key.substring(prefix.length()) : key;

                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * Load properties from a classpath resource into {@code p}. A missing resource isn't
     * an error; it just leaves {@code p} untouched and returns false.
     */
    public static boolean loadFromClasspath(final Properties p, final String resource) {
        final ClassLoader cl = Thread.currentThread().getContextClassLoader() == null ? PropertiesUtils.class.getClassLoader()
            : Thread.currentThread().getContextClassLoader();

        try(InputStream is = cl.getResourceAsStream(resource);) {
            if(is == null) {
                LOGGER.debug("No \"{}\" on the classpath", resource);
                return false;
            }
            p.load(is);
        } catch(final IOException ioe) {
            LOGGER.warn("Couldn't load properties from classpath resource \"{}\"", resource, ioe);
            return false;
        }

        return true;
    }

    /**
     * Copy every system property that starts with {@code sectionName + "."} over the
     * entries in {@code p}.
     */
    public static Properties overrideFromSystem(final Properties p, final String sectionName) {
        final Properties sys = getSection(System.getProperties(), sectionName, false);
        sys.stringPropertyNames().forEach(k -> p.setProperty(k, sys.getProperty(k)));
        return p;
    }

    public static int getInt(final Properties p, final String key, final int defaultValue) {
        final String val = p.getProperty(key);
        if(val == null || val.trim().length() == 0)
            return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new IllegalArgumentException("The property \"" + key + "\" must be an integer but was \"" + val + "\"", nfe);
        }
    }

    public static boolean getBoolean(final Properties p, final String key, final boolean defaultValue) {
        final String val = p.getProperty(key);
        if(val == null)
            return defaultValue;
        // a key that's present but empty means "on", same as the -D switches
        return "".equals(val.trim()) || Boolean.parseBoolean(val.trim());
    }
}
