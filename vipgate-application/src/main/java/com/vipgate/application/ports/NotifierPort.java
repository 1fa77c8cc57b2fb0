package com.vipgate.application.ports;

public interface NotifierPort {

  void sendDirectMessage(long memberId, String text) throws NotificationException;
}
