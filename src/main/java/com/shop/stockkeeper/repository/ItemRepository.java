package com.shop.stockkeeper.repository;

import com.shop.stockkeeper.model.Item;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Every finder takes the owning shop; items are never looked up by id alone.
 */
public interface ItemRepository extends JpaRepository<Item, Long> {

    List<Item> findByShopIdOrderByIdDesc(Long shopId);

    Optional<Item> findByIdAndShopId(Long id, Long shopId);

    /**
     * Same as {@link #findByIdAndShopId} but takes a write lock on the row, so
     * concurrent sales of one item queue behind each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Item i WHERE i.id = :id AND i.shop.id = :shopId")
    Optional<Item> findByIdAndShopIdForUpdate(@Param("id") Long id, @Param("shopId") Long shopId);

    /**
     * Conditional stock decrement.
     *
     * @return 1 when the stock covered the quantity, 0 otherwise
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Item i SET i.quantity = i.quantity - :quantity " +
           "WHERE i.id = :id AND i.shop.id = :shopId AND i.quantity >= :quantity")
    int decrementStock(@Param("id") Long id, @Param("shopId") Long shopId, @Param("quantity") int quantity);
}
