package com.share_link_repair.service.repair;

import com.share_link_repair.repository.ShareRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ShareRemediator {

    private final ShareRepository shareRepository;

    /**
     * Delete the share in its own transaction. A share that is already gone is not an error.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void deleteShare(Integer id) {
        int deleted = shareRepository.deleteShareById(id);
        if (deleted == 0) {
            log.debug("Share {} already removed", id);
        } else {
            log.debug("Removed share {}", id);
        }
    }
}
