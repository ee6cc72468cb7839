package com.autopar.fixture;

import java.util.ArrayList;
import java.util.List;

public class Scoring {

    public static int weight(int x) {
        return x * x + 1;
    }

    public static List<Integer> clampAll(List<Integer> xs, int limit) {
        List<Integer> out = new ArrayList<>();
        for (int x : xs) {
            out.add(x > limit ? limit : x);
        }
        return out;
    }
}
