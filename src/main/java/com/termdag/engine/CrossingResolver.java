package com.termdag.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Finds layers whose direct edges must cross under the chosen row order and
 * switches them to bus routing.
 *
 * <p>
 * Straight edges can be laid out without crossings exactly when sorting them
 * parent-major and child-major gives the same sequence. Any layer where the
 * two disagree loses its direct edges and gets a {@link BusLinks} instead.
 */
@Log4j2
public final class CrossingResolver {

    private CrossingResolver() {
    }

    /**
     * @return the indices of the layers switched to bus routing.
     */
    public static List<Integer> resolve(GraphContext ctx) {
        Comparator<Edge> parentMajor = Comparator.<Edge>comparingInt(e -> ctx.vertex(e.up).row)
                .thenComparingInt(e -> ctx.vertex(e.down).row);
        Comparator<Edge> childMajor = Comparator.<Edge>comparingInt(e -> ctx.vertex(e.down).row)
                .thenComparingInt(e -> ctx.vertex(e.up).row);

        List<Integer> switched = new ArrayList<>();
        for (Layer layer : ctx.layers) {
            List<Edge> byParent = new ArrayList<>(layer.edges());
            List<Edge> byChild = new ArrayList<>(layer.edges());
            byParent.sort(parentMajor);
            byChild.sort(childMajor);
            if (!sameOrder(byParent, byChild)) {
                layer.links = new BusLinks();
                switched.add(layer.index);
            }
        }
        if (!switched.isEmpty())
            log.debug("Layers {} have unavoidable crossings, routing through a bus", switched);
        return switched;
    }

    private static boolean sameOrder(List<Edge> a, List<Edge> b) {
        for (int i = 0; i < a.size(); i++)
            if (!a.get(i).sameEndpoints(b.get(i)))
                return false;
        return true;
    }
}
