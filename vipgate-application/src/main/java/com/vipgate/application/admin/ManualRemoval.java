package com.vipgate.application.admin;

import com.vipgate.domain.model.SubscriptionRecord;

import java.util.List;

public record ManualRemoval(SubscriptionRecord record, List<Long> groupsRemoved, List<Long> groupsFailed) {

  public ManualRemoval {
    groupsRemoved = List.copyOf(groupsRemoved);
    groupsFailed = List.copyOf(groupsFailed);
  }
}
