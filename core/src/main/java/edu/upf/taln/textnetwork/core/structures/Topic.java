package edu.upf.taln.textnetwork.core.structures;

import java.awt.Color;
import java.io.Serializable;
import java.util.Objects;

/**
 * A node of a text network. Nodes are identified by their id, which is the label they were created with.
 * Display label and color are cosmetic.
 */
public final class Topic implements Serializable
{
	private final String id; // should be unique
	private String label;
	private Color color = Color.GRAY;
	private final static long serialVersionUID = 1L;

	public Topic(String id)
	{
		this.id = Objects.requireNonNull(id);
		this.label = id;
	}

	public String getId() { return id; }
	public String getLabel() { return label; }
	public void setLabel(String label) { this.label = label; }
	public Color getColor() { return color; }
	public void setColor(Color color) { this.color = color; }

	@Override
	public String toString() { return label; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Topic topic = (Topic) o;
		return id.equals(topic.id);
	}

	@Override
	public int hashCode() { return id.hashCode(); }
}
