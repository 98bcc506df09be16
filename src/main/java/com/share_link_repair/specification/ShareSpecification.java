package com.share_link_repair.specification;

import com.share_link_repair.entity.Share;
import com.share_link_repair.enumeration.ShareTypeEnum;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

public class ShareSpecification {

    private ShareSpecification() {
    }

    /**
     * Link shares that hang below another share.
     */
    public static Specification<Share> candidateLinkShares() {
        return (root, query, cb) -> cb.and(
                cb.isNotNull(root.get("parent")),
                cb.equal(root.get("shareType"), ShareTypeEnum.LINK.getCode())
        );
    }

    /**
     * Joins a candidate link share to its parent and keeps the pair when the parent is a
     * user or group share on the same item. {@code parent} must be an independent root.
     */
    public static Predicate unsafeChain(Root<Share> link, Root<Share> parent, CriteriaQuery<?> query, CriteriaBuilder cb) {
        List<Predicate> predicates = new ArrayList<>();

        // 1. inner selection on s1
        predicates.add(candidateLinkShares().toPredicate(link, query, cb));

        // 2. s1.parent = s2.id
        predicates.add(cb.equal(link.get("parent"), parent.get("id")));

        // 3. s2 is a user or group share
        predicates.add(cb.or(
                cb.equal(parent.get("shareType"), ShareTypeEnum.USER.getCode()),
                cb.equal(parent.get("shareType"), ShareTypeEnum.GROUP.getCode())
        ));

        // 4. same resource
        predicates.add(cb.equal(link.get("itemSource"), parent.get("itemSource")));

        return cb.and(predicates.toArray(new Predicate[0]));
    }
}
