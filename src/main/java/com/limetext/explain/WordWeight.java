package com.limetext.explain;

public record WordWeight(String word, double weight) {
}
