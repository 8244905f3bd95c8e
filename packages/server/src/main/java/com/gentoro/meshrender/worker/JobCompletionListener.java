package com.gentoro.meshrender.worker;

import com.gentoro.meshrender.queue.RenderJob;

/** Told about every job the worker is done with, successful or not. */
@FunctionalInterface
public interface JobCompletionListener {

  JobCompletionListener NONE = (job, succeeded) -> {};

  void onFinished(RenderJob job, boolean succeeded);
}
