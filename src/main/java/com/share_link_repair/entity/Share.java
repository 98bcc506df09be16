package com.share_link_repair.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Table(name = "share")
public class Share {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    // Not an association; a child may outlive its parent
    @Column(name = "parent")
    private Integer parent;

    @Column(name = "share_type", nullable = false)
    private Integer shareType;

    @Column(name = "item_source", nullable = false)
    private String itemSource;

    @Column(name = "uid_owner", nullable = false, length = 64)
    private String uidOwner;

    @Column(name = "uid_initiator", length = 64)
    private String uidInitiator;
}
