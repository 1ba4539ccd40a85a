package edu.upf.taln.textnetwork.core;

import java.awt.Color;

public class Options
{
	public boolean verbose = false; // log the propositions extracted from each sentence
	public Color node_color = new Color(0.5f, 0.5f, 0.5f); // color assigned to new nodes
	public Color edge_color = new Color(0.5f, 0.5f, 0.5f); // color assigned to new edges
	public String possession_label = "has"; // label of edges linking a noun phrase to its prepositional complement

	public Options() {}

	public Options(Options o)
	{
		this.verbose = o.verbose;
		this.node_color = o.node_color;
		this.edge_color = o.edge_color;
		this.possession_label = o.possession_label;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\tverbose = " + verbose +
				"\n\tnode_color = " + node_color +
				"\n\tedge_color = " + edge_color +
				"\n\tpossession_label = " + possession_label;
	}
}
