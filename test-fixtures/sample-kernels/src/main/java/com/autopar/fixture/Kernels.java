package com.autopar.fixture;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class Kernels {

    public static List<Integer> doubleAll(List<Integer> xs) {
        List<Integer> out = new ArrayList<>();
        for (int x : xs) {
            out.add(x * 2);
        }
        return out;
    }

    public static int sumAll(List<Integer> xs) {
        int total = 0;
        for (int x : xs) {
            total += x;
        }
        return total;
    }

    public static int[] squares(int n) {
        int[] result = new int[n];
        for (int i = 0; i < n; i++) {
            result[i] = i * i;
        }
        return result;
    }

    public static int fib(int n) {
        if (n < 2) {
            return n;
        }
        return fib(n - 1) + fib(n - 2);
    }

    public static void printAll(List<Integer> xs) {
        for (int x : xs) {
            System.out.println("value " + x);
        }
    }

    public static void writeAll() throws IOException {
        for (int i = 0; i < 4; i++) {
            Files.writeString(Path.of("out_" + i + ".txt"), "row " + i);
        }
    }

    public static int countUp(int n) {
        int i = 0;
        while (i < n) {
            i++;
        }
        return i;
    }

    public static List<Integer> untilNegative(List<Integer> xs) {
        List<Integer> out = new ArrayList<>();
        for (int x : xs) {
            if (x < 0) {
                break;
            }
            out.add(x);
        }
        return out;
    }

    public static List<Integer> scoreAll(List<Integer> xs) {
        List<Integer> out = new ArrayList<>();
        for (int x : xs) {
            out.add(Scoring.weight(x));
        }
        return out;
    }
}
