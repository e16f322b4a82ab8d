package com.mk.fx.qa.load.runner.executors;

import com.mk.fx.qa.load.runner.model.Result;
import com.mk.fx.qa.load.runner.model.SendStamp;

/**
 * Performs the single request authorised by a tick.
 *
 * <p>Implementations report failures through the returned {@link Result} instead of throwing; a
 * thrown exception is still turned into a failed result by the worker.
 */
@FunctionalInterface
public interface RequestExecutor {

  /**
   * Sends one request.
   *
   * @param stamp sequence number and send time assigned to this request
   * @return the outcome, never null
   */
  Result execute(SendStamp stamp);
}
