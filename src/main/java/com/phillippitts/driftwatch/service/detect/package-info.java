/** Drift signals: adaptive windowing change detection and the fixed-baseline comparison. */
package com.phillippitts.driftwatch.service.detect;
