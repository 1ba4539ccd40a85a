package edu.upf.taln.textnetwork.core.structures;

import java.util.Optional;

/**
 * Storage of nodes and edges populated by the compiler.
 * Implementations are not expected to be thread-safe: a single writer must own a store while compiling into it.
 */
public interface GraphStore
{
	Optional<Topic> findNode(String label);
	Topic createNode(String label); // not added to the store until addNode is called
	void addNode(Topic node);
	Relation createEdge(Topic source, Topic target); // not added to the store until addEdge is called
	void addEdge(Relation edge);
}
