package com.itq.formledger.service;

import com.itq.formledger.domain.Address;
import com.itq.formledger.entity.LedgerAction;
import com.itq.formledger.entity.LedgerEvent;
import com.itq.formledger.repository.LedgerEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LedgerHistoryService {

    private final LedgerEventRepository eventRepository;
    private final Clock clock;

    /** Joins the caller's transaction: the event commits or rolls back with the state change. */
    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerEvent record(Address account, LedgerAction action, Address actor,
                              String subject, String detail) {
        LedgerEvent event = new LedgerEvent();
        event.setAccountAddress(account);
        event.setAction(action);
        event.setActor(actor);
        event.setSubject(subject);
        event.setRecordedAt(clock.instant().getEpochSecond());
        event.setDetail(detail);
        return eventRepository.save(event);
    }

    @Transactional(readOnly = true)
    public List<LedgerEvent> eventsFor(Address account) {
        return eventRepository.findAllByAccountAddressOrderByIdAsc(account);
    }
}
