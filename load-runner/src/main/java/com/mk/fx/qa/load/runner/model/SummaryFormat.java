package com.mk.fx.qa.load.runner.model;

/** How the end-of-run summary is printed. */
public enum SummaryFormat {
  TEXT,
  JSON
}
