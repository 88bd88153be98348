package com.kotsin.snapshot.host;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kotsin.snapshot.domain.model.RawTriplet;
import com.kotsin.snapshot.domain.model.Scope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One update from the charting host: an indicator triplet for a bar and scope,
 * optionally the latest trade price, and whether the bar has closed.
 *
 * Example:
 * {"feedId":"ES-CH4","barIndex":812,"scope":"CURRENT","reference":6440.0,
 *  "upper":6454.0,"lower":6430.75,"lastPrice":6441.25,"barClosed":true}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HostBarMessage {

    private String feedId;
    private Integer barIndex;
    private Scope scope;

    private Double reference;
    private Double upper;
    private Double lower;

    private Double lastPrice;

    private boolean barClosed;

    public boolean hasTriplet() {
        return barIndex != null && reference != null && upper != null && lower != null;
    }

    public RawTriplet toTriplet() {
        return RawTriplet.of(reference, upper, lower);
    }

    public Scope scopeOrDefault() {
        return scope != null ? scope : Scope.CURRENT;
    }
}
