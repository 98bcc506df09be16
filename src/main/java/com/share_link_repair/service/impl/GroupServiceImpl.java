package com.share_link_repair.service.impl;

import com.share_link_repair.entity.User;
import com.share_link_repair.entity.group.Group;
import com.share_link_repair.repository.group.GroupRepository;
import com.share_link_repair.service.GroupService;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class GroupServiceImpl implements GroupService {

    private final GroupRepository groupRepository;

    @Override
    public Group getGroupByName(String name) {
        return groupRepository.findByName(name)
                .orElseThrow(() -> new EntityNotFoundException("Group not found: " + name));
    }

    @Override
    public Set<User> getAllGroupMembers(String groupName) {
        Group group = groupRepository.findByNameWithMembers(groupName)
                .orElseThrow(() -> new EntityNotFoundException("Group not found: " + groupName));
        Set<User> members = new HashSet<>(group.getMembers());
        log.debug("Group '{}' has {} members", groupName, members.size());
        return members;
    }
}
