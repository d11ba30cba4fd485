package org.nowstart.signalforge.strategy.core;

/**
 * Strategy parameters that declare which strategy version they belong to.
 */
public interface VersionedStrategyParams extends StrategyParams {

    String version();
}
