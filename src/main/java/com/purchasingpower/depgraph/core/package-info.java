/**
 * Core value types of the symbolic graph: addresses, nodes and edges.
 *
 * <p>{@link com.purchasingpower.depgraph.core.AddressCodec} owns the textual
 * address format {@code <project>/<filePath>#<NodeType>:<SymbolName>}; every
 * other package refers to nodes by that canonical string.
 *
 * @since 2.0.0
 */
package com.purchasingpower.depgraph.core;
