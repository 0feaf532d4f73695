package com.meteoalert.service.meteogram;

import com.meteoalert.core.model.PolygonTimeSeries;

public interface MeteogramSource {
    String describe();

    PolygonTimeSeries load();
}
