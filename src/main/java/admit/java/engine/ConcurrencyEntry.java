package admit.java.engine;

/**
 * Active slot count for one key, with the cap it was acquired under.
 */
record ConcurrencyEntry(int active, int max) {

    ConcurrencyEntry {
        if (max < 1) throw new IllegalArgumentException("max must be >= 1");
        if (active < 0 || active > max) throw new IllegalArgumentException("active out of range: " + active);
    }
}
