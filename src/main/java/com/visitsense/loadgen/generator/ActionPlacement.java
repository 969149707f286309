package com.visitsense.loadgen.generator;

import java.util.Arrays;
import java.util.Random;

/**
 * Place les actions optionnelles d'une visite sur ses pages vues.
 *
 * Garanties : avec une seule page vue (ou moins) aucune action n'est placée ;
 * sinon chaque action retenue tombe sur un index de [2, N], jamais sur la page d'entrée.
 */
public final class ActionPlacement {
    public static final int NONE = -1;

    private ActionPlacement() {
    }

    /**
     * @param numPageviews nombre de pages vues de la visite
     * @param wants pour chaque action, true si elle a été tirée
     * @return un index (base 1) par action, ou {@link #NONE}
     */
    public static int[] choose(Random random, int numPageviews, boolean... wants) {
        int[] pages = new int[wants.length];
        Arrays.fill(pages, NONE);
        if (numPageviews <= 1) {
            return pages;
        }
        for (int i = 0; i < wants.length; i++) {
            if (wants[i]) {
                pages[i] = 2 + random.nextInt(numPageviews - 1);
            }
        }
        return pages;
    }
}
