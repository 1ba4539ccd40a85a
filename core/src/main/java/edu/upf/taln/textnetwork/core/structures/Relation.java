package edu.upf.taln.textnetwork.core.structures;

import java.awt.Color;
import java.io.Serializable;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Directed labelled edge between two topics.
 */
public final class Relation implements Serializable
{
	private static final AtomicLong counter = new AtomicLong(0);
	private final Topic source;
	private final Topic target;
	private final long id; // keeps all Relation objects distinct, parallel edges are allowed
	private String label = "";
	private Color color = Color.GRAY;
	private final static long serialVersionUID = 1L;

	public Relation(Topic source, Topic target)
	{
		this.source = source;
		this.target = target;
		this.id = counter.getAndIncrement();
	}

	public Topic getSource() { return source; }
	public Topic getTarget() { return target; }
	public long getId() { return id; }
	public String getLabel() { return label; }
	public void setLabel(String label) { this.label = label; }
	public Color getColor() { return color; }
	public void setColor(Color color) { this.color = color; }
	public boolean isLoop() { return source.equals(target); }

	@Override
	public String toString() { return label + "(" + source.getLabel() + ", " + target.getLabel() + ")"; }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Relation relation = (Relation) o;
		return id == relation.id;
	}

	@Override
	public int hashCode() { return Long.hashCode(id); }
}
