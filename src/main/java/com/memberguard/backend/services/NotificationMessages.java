package com.memberguard.backend.services;

import com.memberguard.backend.lifecycle.ReminderCheckpoint;
import com.memberguard.backend.models.DailySummary;
import com.memberguard.backend.models.Subscription;
import com.memberguard.backend.models.User;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Markdown texts sent to users and to the operators' log channel
 */
public final class NotificationMessages {

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private NotificationMessages() {
    }

    public static String formatDate(OffsetDateTime instant, ZoneId zone) {
        return instant.atZoneSameInstant(zone).format(DATE);
    }

    // ===== Users =====

    public static String reminder(Subscription subscription, ReminderCheckpoint checkpoint, ZoneId zone) {
        String when = checkpoint == ReminderCheckpoint.DAY_0 ? "*today*" : "in *" + checkpoint.getLabel() + "*";
        return "⏰ *Subscription Reminder*\n\n"
                + "Your *" + subscription.getPlanName() + "* subscription expires " + when + ".\n"
                + "📅 Expiry date: " + formatDate(subscription.getExpiryDate(), zone) + "\n\n"
                + "Renew now to keep your access to the premium group.";
    }

    public static String graceStarted(Subscription subscription, int gracePeriodDays, ZoneId zone) {
        return "⚠️ *Subscription Expired*\n\n"
                + "Your *" + subscription.getPlanName() + "* subscription expired on "
                + formatDate(subscription.getExpiryDate(), zone) + ".\n"
                + "You have a grace period of *" + gracePeriodDays + " days* before you are removed from the group.\n\n"
                + "Renew now to keep your access.";
    }

    public static String earlyGraceReminder(int daysLeft) {
        return "⏳ *Grace Period Reminder*\n\n"
                + "Your subscription has expired. You will be removed from the group in *"
                + daysLeft + (daysLeft == 1 ? " day" : " days") + "*.\n\n"
                + "Renew now to stay in.";
    }

    public static String finalGraceWarning() {
        return "🚨 *Final Warning*\n\n"
                + "This is the last day of your grace period. You will be removed from the group tomorrow.\n\n"
                + "Renew now to keep your access.";
    }

    public static String removedAfterGrace() {
        return "❌ *Access Removed*\n\n"
                + "Your grace period has ended and you have been removed from the premium group.\n"
                + "You can request access again at any time.";
    }

    public static String rejoinInvite(String inviteLink, int ttlSeconds) {
        return "🔗 *Rejoin the Group*\n\n"
                + "Your subscription is active but you are not in the group.\n"
                + "Use this one-time link (valid " + Math.max(1, ttlSeconds / 60) + " minutes):\n" + inviteLink;
    }

    public static String approved(Subscription subscription, String inviteLink, ZoneId zone) {
        StringBuilder text = new StringBuilder("✅ *Access Approved*\n\n")
                .append("Plan: *").append(subscription.getPlanName()).append("*\n")
                .append("📅 Valid until: ").append(formatDate(subscription.getExpiryDate(), zone)).append("\n\n");
        if (inviteLink != null) {
            text.append("Join the premium group with this one-time link:\n").append(inviteLink);
        } else {
            text.append("An admin will send your invite link shortly.");
        }
        return text.toString();
    }

    public static String renewed(Subscription subscription, ZoneId zone) {
        return "🔄 *Subscription Renewed*\n\n"
                + "Plan: *" + subscription.getPlanName() + "*\n"
                + "📅 New expiry date: " + formatDate(subscription.getExpiryDate(), zone);
    }

    public static String rejected() {
        return "❌ *Request Rejected*\n\nYour access request was not approved. Contact support for details.";
    }

    public static String cancelled() {
        return "❌ *Subscription Cancelled*\n\nAn admin has cancelled your subscription.";
    }

    public static String referralBonus(User referee, int bonusDays, Subscription extended, ZoneId zone) {
        return "🎁 *Referral Bonus*\n\n"
                + displayName(referee) + " joined with your referral code.\n"
                + "You received *" + bonusDays + " extra days*.\n"
                + "📅 New expiry date: " + formatDate(extended.getExpiryDate(), zone);
    }

    public static String reengagementActive() {
        return "👋 *We miss you!*\n\nYou have not been around for a while. Check the premium group for the latest updates.";
    }

    public static String reengagementExpired() {
        return "👋 *Come back!*\n\nYour subscription expired. Request access again to rejoin the premium group.";
    }

    // ===== Operators =====

    public static String graceStartedAlert(User user, int gracePeriodDays) {
        return "⚠️ Grace period started for " + describe(user) + " (" + gracePeriodDays + " days)";
    }

    public static String removedAlert(User user, String reason) {
        return "🚫 Removed " + describe(user) + " from group: " + reason;
    }

    public static String removalFailedAlert(User user) {
        return "❗ Could not remove " + describe(user) + " from group, will retry on the next run";
    }

    public static String blockedAlert(long telegramId) {
        return "🚫 User `" + telegramId + "` blocked the bot";
    }

    public static String approvedAlert(User user, Subscription subscription, long adminId, boolean renewal) {
        return (renewal ? "🔄 Renewed " : "✅ Approved ") + describe(user)
                + ": " + subscription.getPlanName() + " by admin `" + adminId + "`";
    }

    public static String rejectedAlert(User user, long adminId) {
        return "❌ Rejected " + describe(user) + " by admin `" + adminId + "`";
    }

    public static String cancelledAlert(User user, long adminId) {
        return "🗑 Subscription of " + describe(user) + " cancelled by admin `" + adminId + "`";
    }

    public static String accessRequestAlert(User user, boolean renewal) {
        return "📥 New " + (renewal ? "renewal" : "access") + " request from " + describe(user);
    }

    public static String referralBonusAlert(User referrer, User referee, boolean awarded) {
        return awarded
                ? "🎁 Referral bonus for " + describe(referrer) + " (referred " + describe(referee) + ")"
                : "🎁 Referral bonus dropped for " + describe(referrer) + ": no active subscription";
    }

    public static String broadcastAlert(String target, int sent, int failed) {
        return "📢 Broadcast to " + target + " finished: " + sent + " sent, " + failed + " failed";
    }

    public static String dailySummary(DailySummary summary) {
        return "📊 *Daily Summary " + summary.getDate() + "*\n\n"
                + "New users: " + summary.getNewUsers() + "\n"
                + "Requests received: " + summary.getRequestsReceived() + "\n"
                + "Approvals: " + summary.getApprovals() + "\n"
                + "Renewals: " + summary.getRenewals() + "\n"
                + "Expired today: " + summary.getExpiredToday() + "\n"
                + "Removed from group: " + summary.getRemovedFromGroup() + "\n"
                + "Broadcasts: " + summary.getBroadcasts();
    }

    private static String displayName(User user) {
        return user.getUsername() != null ? "@" + user.getUsername() : user.getName();
    }

    private static String describe(User user) {
        return displayName(user) + " (`" + user.getTelegramId() + "`)";
    }
}
