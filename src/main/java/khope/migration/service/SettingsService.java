package khope.migration.service;

import khope.migration.domain.BoardType;
import khope.migration.domain.Settings;
import khope.migration.domain.Theme;
import khope.migration.dualread.DualReadCache;
import khope.migration.dualread.DualReadResolver;
import khope.migration.dualread.DualReadResult;
import khope.migration.identity.IdentityGuard;
import khope.migration.identity.VerifiedIdentity;
import khope.migration.migration.dto.LegacySettings;
import khope.migration.repository.SettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final SettingsRepository settingsRepository;
    private final DualReadResolver dualReadResolver;
    private final DualReadCache dualReadCache;

    /**
     * 본인 설정 조회. 어디에도 없으면 저장되지 않은 기본 설정을 돌려준다.
     */
    public DualReadResult<Settings, LegacySettings> getSettings(VerifiedIdentity caller) {
        IdentityGuard.requireIdentity(caller);
        DualReadResult<Settings, LegacySettings> result = dualReadResolver.resolveSettings(caller, caller.subject());
        if (!result.isFound()) {
            return DualReadResult.defaulted(Settings.defaultsFor(caller.subject()));
        }
        return result;
    }

    @Transactional
    public Settings updateSettings(VerifiedIdentity caller, SettingsUpdate update) {
        IdentityGuard.requireIdentity(caller);
        Settings settings = findOrCreate(caller.subject());

        if (update.boardType() != null) {
            settings.setBoardType(BoardType.fromValue(update.boardType()));
        }
        if (update.theme() != null) {
            settings.setTheme(Theme.fromValue(update.theme()));
        }
        if (update.language() != null) {
            settings.setLanguage(update.language());
        }
        if (update.autoSave() != null) {
            settings.setAutoSave(update.autoSave());
        }

        return save(settings);
    }

    @Transactional
    public Settings updateTutorialProgress(VerifiedIdentity caller, String step, boolean completed) {
        IdentityGuard.requireIdentity(caller);
        Settings settings = findOrCreate(caller.subject());
        settings.getTutorialCompleted().put(step, completed);
        return save(settings);
    }

    private Settings findOrCreate(String userId) {
        return settingsRepository.findByUserId(userId)
                .orElseGet(() -> Settings.defaultsFor(userId));
    }

    private Settings save(Settings settings) {
        Settings saved = settingsRepository.save(settings);
        dualReadCache.evict(settings.getUserId());
        log.debug("설정 저장 - userId: {}", settings.getUserId());
        return saved;
    }

    public record SettingsUpdate(
            String boardType,
            String theme,
            String language,
            Boolean autoSave
    ) {}
}
