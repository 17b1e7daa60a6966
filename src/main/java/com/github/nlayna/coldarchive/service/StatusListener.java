package com.github.nlayna.coldarchive.service;

import com.github.nlayna.coldarchive.model.Notification;

@FunctionalInterface
public interface StatusListener {

    void onNotification(Notification notification);
}
