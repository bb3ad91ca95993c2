package io.branchlite.repo;

/**
 * @param create                  create the branch from HEAD when it does not exist.
 * @param skipStateReconstruction move HEAD without calling the {@link StateReconstructor}.
 */
public record CheckoutOptions(boolean create, boolean skipStateReconstruction) {

    public static CheckoutOptions defaults() { return new CheckoutOptions(false, false); }

    public static CheckoutOptions creating() { return new CheckoutOptions(true, false); }
}
