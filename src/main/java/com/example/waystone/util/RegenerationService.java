package com.example.waystone.util;

import com.example.waystone.model.PlayerCharacter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Natural hit point regeneration for online characters, run once per tick.
 *
 * Base regen is 5% of max HP plus the constitution modifier (if positive),
 * multiplied by the stance factor:
 * - STANDING: x1
 * - RESTING:  x2
 * - SLEEPING: x4
 * A damaged character always gets at least 1 HP.
 */
public class RegenerationService {
    private static final Logger logger = LoggerFactory.getLogger(RegenerationService.class);

    public static final String TICK_NAME = "regeneration";
    private static final int BASE_REGEN_PERCENT = 5;

    private final Supplier<Collection<PlayerCharacter>> onlineCharacters;

    public RegenerationService(Supplier<Collection<PlayerCharacter>> onlineCharacters) {
        this.onlineCharacters = onlineCharacters;
    }

    public void initialize(TickService tickService) {
        tickService.register(TICK_NAME, this::tick);
    }

    /**
     * Heal every damaged online character.
     *
     * @return number of characters healed
     */
    public int tick() {
        int healed = 0;
        for (PlayerCharacter ch : onlineCharacters.get()) {
            int hp = ch.getCurrentHp();
            if (hp >= ch.getMaxHp()) continue;
            int amount = calculateRegenAmount(ch);
            ch.setCurrentHp(hp + amount);
            healed++;
            logger.debug("Character {} regenerated {} HP ({} -> {})", ch.getName(), amount, hp, ch.getCurrentHp());
        }
        if (healed > 0) {
            logger.info("Regeneration tick healed {} character(s)", healed);
        }
        return healed;
    }

    public static int calculateRegenAmount(PlayerCharacter ch) {
        int base = ch.getMaxHp() * BASE_REGEN_PERCENT / 100;
        int conBonus = Math.max(0, PlayerCharacter.modifier(ch.getConstitution()));
        int total = (base + conBonus) * ch.getStance().getRegenMultiplier();
        return Math.max(1, total);
    }
}
