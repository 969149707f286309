package com.visitsense.loadgen.transport;

import com.visitsense.loadgen.core.TrackingHit;

/**
 * Envoi d'un hit de tracking vers une destination.
 * Les implémentations ne lèvent jamais d'exception pour un échec réseau :
 * l'échec est compté puis signalé par le retour.
 */
public interface HitSender {

    /**
     * Envoie un hit (une seule tentative, sans relance).
     * @return true si la destination a répondu 2xx
     */
    boolean send(TrackingHit hit);

    /**
     * Nombre de hits envoyés avec succès depuis le démarrage
     */
    long getSentCount();

    /**
     * Nombre d'échecs (réseau, timeout, statut non 2xx)
     */
    long getFailedCount();
}
