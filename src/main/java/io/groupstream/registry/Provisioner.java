package io.groupstream.registry;

/**
 * Brings up a group's dispatcher and returns its endpoint once it is ready.
 */
@FunctionalInterface
public interface Provisioner {
    String provision() throws Exception;
}
