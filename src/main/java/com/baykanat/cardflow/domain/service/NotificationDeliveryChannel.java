package com.baykanat.cardflow.domain.service;

import com.baykanat.cardflow.domain.model.NotificationBatch;

/** Dış gönderim (e-posta/push) için teslim kanalı. Hata fırlatırsa bundle yeniden denenir. */
public interface NotificationDeliveryChannel {

    void deliver(String recipientId, NotificationBatch batch);
}
