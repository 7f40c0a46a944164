package org.nowstart.lending.service.swap;

import java.util.List;

/**
 * Token path for a swap, first element sold, last element bought.
 */
public record SwapRoute(List<String> path) {

    public SwapRoute {
        if (path == null || path.size() < 2) {
            throw new IllegalArgumentException("Swap route needs at least two tokens");
        }
        for (int i = 1; i < path.size(); i++) {
            if (path.get(i).equals(path.get(i - 1))) {
                throw new IllegalArgumentException("Swap route repeats token " + path.get(i));
            }
        }
        path = List.copyOf(path);
    }

    public String tokenIn() {
        return path.get(0);
    }

    public String tokenOut() {
        return path.get(path.size() - 1);
    }
}
