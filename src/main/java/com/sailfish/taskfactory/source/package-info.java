/**
 * Source retrieval for cache identity derivation: the {@link com.sailfish.taskfactory.source.SourceProvider}
 * capability and its classpath and source-tree implementations.
 */
package com.sailfish.taskfactory.source;
