package com.titanic.inference.features;

import java.util.Objects;

/**
 * Passenger attributes. Requests always carry all of them; a null {@code age},
 * {@code fare} or {@code embarked} is imputed during transformation.
 */
public record PassengerFeatures(
    int pclass,
    Sex sex,
    Double age,
    int sibsp,
    int parch,
    Double fare,
    Embarked embarked
) {
    public PassengerFeatures {
        Objects.requireNonNull(sex, "sex");
    }

    public int familySize() {
        return sibsp + parch + 1;
    }
}
