package com.example.fuel.planner;

import lombok.Value;

/**
 * Fixed vehicle range and efficiency model.
 */
@Value
public class VehicleProfile {
    /** Miles travelable on a full tank. */
    double rangeMiles;
    double milesPerGallon;

    public VehicleProfile(double rangeMiles, double milesPerGallon) {
        if (!(rangeMiles > 0)) {
            throw new IllegalArgumentException("rangeMiles must be > 0, got " + rangeMiles);
        }
        if (!(milesPerGallon > 0)) {
            throw new IllegalArgumentException("milesPerGallon must be > 0, got " + milesPerGallon);
        }
        this.rangeMiles = rangeMiles;
        this.milesPerGallon = milesPerGallon;
    }

    public double fullTankGallons() {
        return rangeMiles / milesPerGallon;
    }

    public double gallonsFor(double miles) {
        return miles / milesPerGallon;
    }
}
