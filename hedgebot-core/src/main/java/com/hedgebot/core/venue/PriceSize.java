package com.hedgebot.core.venue;

public record PriceSize(double price, double size) {}
