package com.hcltech.textres.resources.source;

import com.hcltech.textres.resources.locate.DirectoryLister;

/**
 * Where resource files live: something that can list logical file names and read their text.
 * Logical names are dotted paths relative to the source root, e.g. {@code Resources.Greeting_de.txt}.
 */
public interface ResourceSource extends DirectoryLister, TextReader {
}
