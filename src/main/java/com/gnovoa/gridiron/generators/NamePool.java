package com.gnovoa.gridiron.generators;

import com.gnovoa.gridiron.sim.RandomSource;

final class NamePool {

    private static final String[] FIRST = {
            "Aaron", "Andre", "Ben", "Brandon", "Caleb", "Cam", "Chris", "Cole", "Darius", "Derek",
            "Devin", "Dylan", "Eli", "Evan", "Gabe", "Grant", "Hunter", "Isaiah", "Jalen", "Jamal",
            "Jordan", "Josh", "Justin", "Kyle", "Lamar", "Luke", "Malik", "Marcus", "Mason", "Miles",
            "Nate", "Noah", "Omar", "Parker", "Quinn", "Reggie", "Ryan", "Sam", "Terrell", "Trey",
            "Tyler", "Victor", "Wes", "Xavier", "Zach"
    };

    private static final String[] LAST = {
            "Adams", "Allen", "Baker", "Banks", "Bell", "Brooks", "Carter", "Coleman", "Davis", "Dixon",
            "Edwards", "Ellis", "Fisher", "Ford", "Graham", "Green", "Hayes", "Hill", "Howard", "Jackson",
            "Jenkins", "Johnson", "Kelly", "King", "Lewis", "Marshall", "Mitchell", "Moore", "Morris", "Nelson",
            "Owens", "Parker", "Perry", "Price", "Reed", "Robinson", "Ross", "Sanders", "Scott", "Stewart",
            "Taylor", "Thomas", "Turner", "Walker", "Ward", "Washington", "Watson", "White", "Williams", "Young"
    };

    private NamePool() {}

    static String firstName(RandomSource rnd) {
        return FIRST[rnd.nextIntInclusive(0, FIRST.length - 1)];
    }

    static String lastName(RandomSource rnd) {
        return LAST[rnd.nextIntInclusive(0, LAST.length - 1)];
    }
}
