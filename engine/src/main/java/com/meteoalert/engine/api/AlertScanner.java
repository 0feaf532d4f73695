package com.meteoalert.engine.api;

import com.meteoalert.core.model.AlertKind;

public interface AlertScanner {
    AlertKind kind();

    ScanResult scan(ScanContext ctx);
}
