package com.routely.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Station {

    private String id;
    private String name;
    private double lat;
    private double lon;
    private int zoneNumber;
    private boolean interchange;

    // Owning line, a station served by two lines is modelled as two stations joined by a transfer link
    private String lineId;
}
