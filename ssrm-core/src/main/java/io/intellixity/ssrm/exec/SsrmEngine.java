package io.intellixity.ssrm.exec;

import io.intellixity.ssrm.request.SsrmRequest;

/** Executes one validated request against a backend and returns the shaped page. */
public interface SsrmEngine {
  SsrmResult fetchRows(SsrmScope scope, SsrmRequest request);
}
