package org.jsguard;

public interface NodeListener
{
	public void accept(NodeContext context) throws JSGuardException;
}
