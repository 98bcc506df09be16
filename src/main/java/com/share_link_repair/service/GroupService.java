package com.share_link_repair.service;

import com.share_link_repair.entity.User;
import com.share_link_repair.entity.group.Group;

import java.util.Set;

public interface GroupService {

    /**
     * Get a group by its unique name.
     */
    Group getGroupByName(String name);

    /**
     * Get all members of a group.
     */
    Set<User> getAllGroupMembers(String groupName);
}
